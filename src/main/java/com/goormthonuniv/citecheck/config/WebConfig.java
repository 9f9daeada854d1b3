package com.goormthonuniv.citecheck.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig {

    @Bean
    public RestClient restClient(RestClient.Builder builder, CiteCheckProperties props) {
        CiteCheckProperties.Http http = props.getHttp();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(http.getConnectTimeout());
        factory.setReadTimeout(http.getReadTimeout());
        return builder
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
                .build();
    }

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins("*")
                        .allowedMethods("GET","POST","OPTIONS");
            }
        };
    }
}
