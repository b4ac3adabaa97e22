package com.panelkit.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * PanelKit application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.panelkit")
public class PanelKitApplication {

    public static void main(String[] args) {
        SpringApplication.run(PanelKitApplication.class, args);
    }
}
