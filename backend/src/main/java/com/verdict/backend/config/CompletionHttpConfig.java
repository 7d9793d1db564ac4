package com.verdict.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class CompletionHttpConfig {

    @Bean
    public RestTemplate completionRestTemplate(CompletionProperties completionProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(completionProperties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(completionProperties.getHttp().getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
