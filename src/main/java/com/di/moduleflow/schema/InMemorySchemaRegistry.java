package com.di.moduleflow.schema;

import com.di.moduleflow.dataset.RequiredSchema;
import com.di.moduleflow.model.Module;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link SchemaRegistry} keyed by module id. Schemas are registered while the
 * pipeline is assembled, before any module runs.
 */
@Slf4j
public class InMemorySchemaRegistry implements SchemaRegistry {

    private final Map<Integer, RequiredSchema> byModuleId = new ConcurrentHashMap<>();

    public InMemorySchemaRegistry register(int moduleId, RequiredSchema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null for module " + moduleId);
        }
        RequiredSchema previous = byModuleId.put(moduleId, schema);
        if (previous != null) {
            log.warn("[SCHEMA] minimum schema for module {} replaced", moduleId);
        }
        return this;
    }

    @Override
    public RequiredSchema get(Module module) {
        return byModuleId.getOrDefault(module.moduleId(), RequiredSchema.empty());
    }
}
