package perf.foresight.error.exception;

import perf.foresight.error.AnalyticsErrorCode;
import perf.foresight.error.exception.base.ServerBaseException;

/** Numerical degeneracy during training, e.g. a fit that overflows to a non-finite value. */
public class ModelTrainingException extends ServerBaseException {

  public ModelTrainingException(String modelName, String reason) {
    super(AnalyticsErrorCode.MODEL_TRAINING_FAILURE, modelName, reason);
  }

  public ModelTrainingException(String modelName, String reason, Throwable cause) {
    super(AnalyticsErrorCode.MODEL_TRAINING_FAILURE, cause, modelName, reason);
  }
}
