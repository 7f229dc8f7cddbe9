package com.example.corprisk.service.analyzer;

import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.model.DimensionResult;

/**
 * One analyzer unit. Implementations read only what they need from the registry, collect
 * evidence and let their dimension's cascade decide the rating. Missing upstream data
 * yields a degraded "investigate" result rather than an exception.
 */
public interface DimensionAnalyzer {

    Dimension dimension();

    DimensionResult analyze(RegistryClient registry, String companyNumber);
}
