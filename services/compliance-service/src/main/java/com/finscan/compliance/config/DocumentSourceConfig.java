package com.finscan.compliance.config;

import com.finscan.compliance.document.DocumentSource;
import com.finscan.compliance.document.PdfBoxDocumentSource;
import com.finscan.compliance.document.RemoteDocumentFetcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class DocumentSourceConfig {

    @Bean
    @Qualifier("documentWebClient")
    WebClient documentWebClient(ComplianceProperties properties) {
        int maxBytes = Math.max(1, properties.getRemoteMaxInMemoryMb()) * 1024 * 1024;
        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
        return WebClient.builder()
            .defaultHeader("User-Agent", properties.getUserAgent())
            .defaultHeader("Accept", "application/pdf, */*")
            .exchangeStrategies(strategies)
            .build();
    }

    @Bean
    DocumentSource documentSource(
        ComplianceProperties properties,
        @Qualifier("documentWebClient") WebClient documentWebClient
    ) {
        RemoteDocumentFetcher fetcher = properties.isRemoteDocumentsEnabled()
            ? new RemoteDocumentFetcher(documentWebClient)
            : null;
        return new PdfBoxDocumentSource(fetcher, properties.getTableColumnGap());
    }
}
