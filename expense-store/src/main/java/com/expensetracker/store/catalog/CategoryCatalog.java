package com.expensetracker.store.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 类说明 / Class Description:
 * 中文：只读的分类目录资源（expense://categories），原样提供静态 JSON 文档，供调用方参考。
 * English: Read-only category catalog resource (expense://categories) serving a static JSON document as-is for callers.
 *
 * 设计目的 / Design Purpose:
 * 中文：存储层不依据目录校验 category，两者之间没有外键约束。
 * English: The store never validates category against the catalog; there is no foreign-key relationship.
 */
@Slf4j
@Component
public class CategoryCatalog {

    public static final String URI = "expense://categories";
    public static final String MIME_TYPE = "application/json";

    private final Resource document;
    private final ObjectMapper objectMapper;

    public CategoryCatalog(@Value("${expense.catalog.location:classpath:categories.json}") Resource document,
                           ObjectMapper objectMapper) {
        this.document = document;
        this.objectMapper = objectMapper;
    }

    /**
     * @return 目录文档的原始 JSON 文本（UTF-8）
     */
    public String read() {
        try (InputStream in = document.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CatalogUnavailableException("Unable to read category catalog " + document.getDescription(), ex);
        }
    }

    /**
     * 解析目录中的分类名，保持文档顺序。支持字符串数组，或带 categories 数组的对象
     * （数组元素为字符串或含 name 字段的对象）。
     */
    public List<String> categoryNames() {
        JsonNode root;
        try {
            root = objectMapper.readTree(read());
        } catch (JsonProcessingException ex) {
            throw new CatalogUnavailableException("Category catalog is not valid JSON: " + document.getDescription(), ex);
        }

        JsonNode items = root.isArray() ? root : root.path("categories");
        if (!items.isArray()) {
            throw new CatalogUnavailableException("Category catalog has no categories array: " + document.getDescription());
        }

        List<String> names = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            if (item.isTextual()) {
                names.add(item.asText());
            } else if (item.hasNonNull("name")) {
                names.add(item.get("name").asText());
            } else {
                log.warn("Skipping unnamed catalog entry {} / 跳过无名称的目录项", item);
            }
        }
        return List.copyOf(names);
    }
}
