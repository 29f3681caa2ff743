package com.baykanat.insider.funnel.domain.mapper;

import com.baykanat.insider.funnel.api.dto.SessionEventResponse;
import com.baykanat.insider.funnel.api.dto.TrackingEventRequest;
import com.baykanat.insider.funnel.domain.model.EventType;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import com.baykanat.insider.funnel.domain.model.TrackingEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.mapstruct.AfterMapping;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

import java.util.List;

/** TrackingEventRequest → TrackingEvent, TrackingEvent → SessionEventResponse ve Kafka record value dönüşümleri. */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface TrackingEventMapper {

    /** Kafka value Map olarak gelirse dönüşüm için; Instant alanları için java.time modülü yüklenir. */
    ObjectMapper JSON_MAPPER = JsonMapper.builder().findAndAddModules().build();

    @Mapping(target = "eventTimestamp", source = "request.timestamp")
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "receivedAt", ignore = true)
    TrackingEvent toTrackingEvent(TrackingEventRequest request, String idempotencyKey);

    @Mapping(target = "eventType", expression = "java(event.resolveEventType().getValue())")
    SessionEventResponse toSessionEvent(TrackingEvent event);

    List<SessionEventResponse> toSessionEvents(List<TrackingEvent> events);

    /** PII yalnızca form_complete event'inde saklanır; diğer tiplerde gönderilse de düşülür. */
    @AfterMapping
    default void dropPiiUnlessFormComplete(@MappingTarget TrackingEvent event) {
        if (event.resolveEventType() != EventType.FORM_COMPLETE) {
            event.setFirstName(null);
            event.setLastName(null);
            event.setEmail(null);
            event.setPhone(null);
        }
    }

    /** Gruplanabilir alanlarda boş ve sentinel değerler null saklanır. */
    @AfterMapping
    default void normalizeDimensions(@MappingTarget TrackingEvent event) {
        event.setFunnelId(GroupingDimension.FUNNEL_ID.normalize(event.getFunnelId()));
        event.setDeviceType(GroupingDimension.DEVICE_TYPE.normalize(event.getDeviceType()));
        event.setGeoState(GroupingDimension.GEO_STATE.normalize(event.getGeoState()));
        event.setSelectedState(GroupingDimension.SELECTED_STATE.normalize(event.getSelectedState()));
        event.setUtmSource(GroupingDimension.UTM_SOURCE.normalize(event.getUtmSource()));
        event.setUtmCampaign(GroupingDimension.UTM_CAMPAIGN.normalize(event.getUtmCampaign()));
        event.setUtmMedium(GroupingDimension.UTM_MEDIUM.normalize(event.getUtmMedium()));
    }

    /** Kafka value TrackingEventRequest ise döner, değilse Map vb. üzerinden çevirir. */
    default TrackingEventRequest fromRecordValue(Object value) {
        if (value instanceof TrackingEventRequest request) {
            return request;
        }
        return JSON_MAPPER.convertValue(value, TrackingEventRequest.class);
    }
}
