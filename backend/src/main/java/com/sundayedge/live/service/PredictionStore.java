package com.sundayedge.live.service;

import com.sundayedge.live.model.Prediction;
import java.util.List;

/** Key-value persistence for ledger records, keyed by prediction id. */
public interface PredictionStore {
  /**
   * @throws LedgerStoreException when the stored records cannot be read back
   */
  List<Prediction> loadAll();

  void save(Prediction prediction);
}
