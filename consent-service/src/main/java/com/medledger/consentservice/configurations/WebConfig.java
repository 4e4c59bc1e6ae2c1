package com.medledger.consentservice.configurations;

import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.ResourceType;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets query parameters use the same lower-case wire names as JSON bodies
 * ({@code lab_result}, {@code read}, {@code consent_granted}).
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(new Converter<String, ResourceType>() {
            @Override
            public ResourceType convert(String source) {
                return ResourceType.fromValue(source);
            }
        });
        registry.addConverter(new Converter<String, AccessLevel>() {
            @Override
            public AccessLevel convert(String source) {
                return AccessLevel.fromValue(source);
            }
        });
        registry.addConverter(new Converter<String, AuditEventType>() {
            @Override
            public AuditEventType convert(String source) {
                return AuditEventType.fromValue(source);
            }
        });
    }
}
