package com.finscan.compliance.document;

import com.finscan.compliance.exception.DocumentOpenException;
import java.net.URI;
import java.util.Locale;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Downloads documents referenced by an {@code http(s)} URL into memory.
 */
public class RemoteDocumentFetcher {

    private final WebClient webClient;

    public RemoteDocumentFetcher(WebClient webClient) {
        this.webClient = webClient;
    }

    public static boolean isRemote(String reference) {
        String lower = reference.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    public byte[] fetch(String url) {
        byte[] bytes;
        try {
            bytes = webClient.get()
                .uri(URI.create(url))
                .retrieve()
                .bodyToMono(byte[].class)
                .block();
        } catch (RuntimeException e) {
            throw new DocumentOpenException("could not download " + url + " (" + e.getMessage() + ")", e);
        }

        if (bytes == null || bytes.length == 0) {
            throw new DocumentOpenException("downloaded document payload is empty for " + url);
        }
        return bytes;
    }
}
