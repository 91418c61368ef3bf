package com.treeroll.service.core.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor objectMapperDecimalCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    configure(om);
                }
                return bean;
            }
        };
    }

    /** Measures stay exact decimals end to end; definition files may carry keys we do not model. */
    public static ObjectMapper configure(ObjectMapper om) {
        om.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        om.configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
        return om;
    }
}
