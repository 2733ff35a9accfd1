package com.dnobretech.loaningestor.client;

import com.dnobretech.loaningestor.dto.AdvisoryMapping;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodifica a resposta do oráculo. Formatos aceitos:
 * <pre>
 *   {"mapping": {...}}                      raiz
 *   {"result": {"mapping": {...}}}          um nível
 *   {"result": {"result": {...}}}           dois níveis
 *   {"result": {...}}                       o próprio result é o mapeamento
 *   qualquer um dos acima com o mapeamento (ou o result) como string JSON
 * </pre>
 * Nunca lança: qualquer outra coisa vira mapeamento vazio (fallback).
 */
@Component
@RequiredArgsConstructor
public class MappingResponseDecoder {

    private static final int MAX_RESULT_DEPTH = 2;

    private final ObjectMapper mapper;

    public AdvisoryMapping decode(String body) {
        if (body == null || body.isBlank()) {
            return AdvisoryMapping.fallback("resposta vazia do oráculo");
        }
        JsonNode root = parse(body);
        if (root == null || !root.isObject()) {
            return AdvisoryMapping.fallback("resposta do oráculo não é um objeto JSON");
        }

        JsonNode mp = locate(root, 0);
        if (mp == null || !mp.isObject()) {
            return AdvisoryMapping.fallback("mapeamento ausente ou malformado");
        }

        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = mp.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if ("is_valid".equals(e.getKey())) continue;
            if (!e.getValue().isTextual()) continue;
            out.put(e.getKey(), e.getValue().asText());
        }
        return AdvisoryMapping.of(out);
    }

    // "mapping" tem precedência sobre "result" no mesmo nível
    private JsonNode locate(JsonNode node, int depth) {
        node = unwrap(node);
        if (node == null || !node.isObject()) return null;
        if (node.has("mapping")) return unwrap(node.get("mapping"));
        if (node.has("result")) {
            return depth < MAX_RESULT_DEPTH ? locate(node.get("result"), depth + 1) : null;
        }
        return depth == 0 ? null : node;
    }

    private JsonNode unwrap(JsonNode node) {
        if (node != null && node.isTextual()) return parse(node.asText());
        return node;
    }

    private JsonNode parse(String text) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
