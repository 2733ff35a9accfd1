package com.dnobretech.loaningestor.client;

import com.dnobretech.loaningestor.dto.AdvisoryMapping;
import com.dnobretech.loaningestor.dto.SourceSheet;
import com.dnobretech.loaningestor.enums.CanonicalField;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client do oráculo (LLM) que sugere coluna da planilha -> campo do banco.
 * A sugestão é só consultiva: falha, timeout ou resposta malformada viram mapeamento vazio,
 * e o reparo por classificação de valores cobre tudo.
 */
@Slf4j
@Component
public class MappingOracleClient {

    private final WebClient web;
    private final ObjectMapper mapper;
    private final MappingResponseDecoder decoder;
    private final String url;
    private final String token;
    private final long timeoutSeconds;

    public MappingOracleClient(ObjectMapper mapper,
                               MappingResponseDecoder decoder,
                               @Value("${loan.oracle.url:http://localhost:8020/map}") String url,
                               @Value("${loan.oracle.token:}") String token,
                               @Value("${loan.oracle.timeout-seconds:60}") long timeoutSeconds) {
        this.mapper = mapper;
        this.decoder = decoder;
        this.url = url;
        this.token = token;
        this.timeoutSeconds = timeoutSeconds;
        this.web = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create().responseTimeout(Duration.ofSeconds(timeoutSeconds))
                ))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    public AdvisoryMapping requestMapping(SourceSheet sheet) {
        try {
            Map<String, Object> task = new LinkedHashMap<>();
            task.put("excel_columns", sheet.headers());
            task.put("database_fields", CanonicalField.columns());
            task.put("data_rows", sheet.records());

            String body = web.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .body(BodyInserters.fromFormData("task", mapper.writeValueAsString(task)))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            log.debug("[oracle] resposta crua: {}", body);
            AdvisoryMapping mapping = decoder.decode(body);
            if (mapping.fallback()) {
                log.warn("[oracle] {}; seguindo sem mapeamento", mapping.reason());
            } else {
                log.info("[oracle] {} colunas mapeadas", mapping.columns().size());
            }
            return mapping;
        } catch (Exception e) {
            log.warn("[oracle] falha/timeout ao chamar {}: {}; seguindo sem mapeamento", url, e.toString());
            return AdvisoryMapping.fallback(e.toString());
        }
    }
}
