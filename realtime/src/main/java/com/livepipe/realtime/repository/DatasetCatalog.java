package com.livepipe.realtime.repository;

import com.livepipe.realtime.model.Dataset;

import java.util.List;
import java.util.Optional;

/** Read-only source of the sample datasets an execution can run over. */
public interface DatasetCatalog {

    List<Dataset> findAll();

    Optional<Dataset> findById(String id);
}
