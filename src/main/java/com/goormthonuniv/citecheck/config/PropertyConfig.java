package com.goormthonuniv.citecheck.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/** CourtListener/Google/Bing 키는 여기(선택 파일) 또는 환경변수로 */
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}
