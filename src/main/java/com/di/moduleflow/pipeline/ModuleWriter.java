package com.di.moduleflow.pipeline;

import com.di.moduleflow.dataset.Dataset;
import com.di.moduleflow.model.Module;
import com.di.moduleflow.model.PipelineTable;

/**
 * Write step of a module: persists the final dataset and produces the run's result, including
 * its persisted status report.
 */
public interface ModuleWriter {

    /** Target written to; also what gets rolled back when a step before the write fails. */
    PipelineTable getTarget();

    /**
     * @param dataset          validated and transformed dataset
     * @param module           owning module
     * @param sourcePartitions partition count observed on the validated source
     */
    ModuleResult write(Dataset dataset, Module module, int sourcePartitions);
}
