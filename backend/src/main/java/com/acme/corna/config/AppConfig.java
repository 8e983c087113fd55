package com.acme.corna.config;

import com.acme.corna.CornaApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConfigurationPropertiesScan(basePackageClasses = CornaApplication.class)
public class AppConfig {
}
