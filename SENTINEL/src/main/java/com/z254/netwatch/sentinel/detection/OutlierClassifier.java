package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.domain.model.FeatureVector;
import com.z254.netwatch.sentinel.domain.model.OutlierPrediction;

/**
 * Pre-trained device-health outlier model.
 * <p>
 * Supplied by the deployment as a Spring bean; SENTINEL only consumes predictions.
 */
public interface OutlierClassifier {

    OutlierPrediction predict(FeatureVector vector);
}
