package com.di.moduleflow.schema;

import com.di.moduleflow.dataset.RequiredSchema;
import com.di.moduleflow.model.Module;

/**
 * Lookup of the minimum schema a module's source must satisfy.
 */
public interface SchemaRegistry {

    /**
     * @return the module's minimum schema; {@link RequiredSchema#empty()} when none is
     *         registered (no constraints)
     */
    RequiredSchema get(Module module);
}
