package com.goormthonuniv.citecheck.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    static final String CITATION_TAG = "Citations";

    @Bean
    public OpenAPI citeCheckOpenApi(CiteCheckProperties props) {
        CiteCheckProperties.Jobs jobs = props.getJobs();
        String description = """
                판결 인용 추출, 병행 인용 클러스터링, 출처 검증 API.
                본문 %d자 또는 인용 %d개를 넘으면 비동기 작업(202)으로 전환되고, 진행률은 폴링으로 확인합니다.
                """.formatted(jobs.getSyncThresholdChars(), jobs.getSyncThresholdCitations());
        return new OpenAPI()
                .info(new Info()
                        .title("CiteCheck Citation API")
                        .description(description)
                        .version("v0.1.0")
                        .contact(new Contact().name("CiteCheck").email("team@citecheck.dev")))
                .tags(List.of(new Tag().name(CITATION_TAG).description("분석 요청, 진행률, 결과, 취소")))
                .externalDocs(new ExternalDocumentation()
                        .description("CourtListener citation lookup")
                        .url("https://www.courtlistener.com/help/api/rest/citation-lookup/"));
    }
}
