package com.wadechandler.notification.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NotificationDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotificationDispatchApplication.class, args);
    }
}
