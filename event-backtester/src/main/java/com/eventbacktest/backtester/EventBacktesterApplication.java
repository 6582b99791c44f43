package com.eventbacktest.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the event-driven backtester service.
 */
@SpringBootApplication
public class EventBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventBacktesterApplication.class, args);
    }

}
