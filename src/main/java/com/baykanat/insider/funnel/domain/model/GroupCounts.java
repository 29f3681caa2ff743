package com.baykanat.insider.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Bir grup (veya tüm kohort) için oturum ve event sayıları; groupValue ham değer, null olabilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupCounts {

    private String groupValue;
    private long uniqueViews;
    private long grossViews;
    private long pageLands;
    private long formCompletions;

    /** Page land yoksa (land event'i göndermeyen funnel'lar) benzersiz oturum sayısına düşer. */
    public long landBase() {
        return pageLands > 0 ? pageLands : uniqueViews;
    }
}
