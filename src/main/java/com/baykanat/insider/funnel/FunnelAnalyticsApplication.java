package com.baykanat.insider.funnel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile inbox cleanup. */
@SpringBootApplication
@EnableScheduling
public class FunnelAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(FunnelAnalyticsApplication.class, args);
	}

}
