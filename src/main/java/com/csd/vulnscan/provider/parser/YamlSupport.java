package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.exception.LockfileParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

final class YamlSupport {

    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private YamlSupport() {}

    /**
     * Reads a YAML document into a tree; an empty document yields a missing node.
     */
    static JsonNode read(String content, String fileLabel) {
        try {
            JsonNode root = mapper.readTree(content);
            return root == null ? MissingNode.getInstance() : root;
        } catch (JsonProcessingException e) {
            throw new LockfileParseException("Invalid " + fileLabel + " format: " + e.getOriginalMessage(), e);
        }
    }
}
