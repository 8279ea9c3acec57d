package perf.foresight.error.exception;

import perf.foresight.error.AnalyticsErrorCode;
import perf.foresight.error.exception.base.ClientBaseException;

/** Predict was called before a successful train. */
public class ModelNotTrainedException extends ClientBaseException {

  public ModelNotTrainedException(String modelName) {
    super(AnalyticsErrorCode.MODEL_NOT_TRAINED, modelName);
  }
}
