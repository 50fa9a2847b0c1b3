package com.roadmonitor.classifier;

import com.roadmonitor.model.AccelerometerSample;
import com.roadmonitor.model.AgentRecord;
import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.RoadState;

/**
 * Классификатор состояния дороги по вертикальному ускорению (ось z).
 * <p>
 * Интервалы:
 * <ul>
 *   <li>(14000, 18000]: normal;</li>
 *   <li>(12000, 14000) и (18000, 20000): small_pits;</li>
 *   <li>всё остальное, включая границы 12000, 14000 и 20000: large_pits.</li>
 * </ul>
 */
public final class RoadStateClassifier {

  private static final double NORMAL_LOWER = 14000;
  private static final double NORMAL_UPPER = 18000;
  private static final double SMALL_PITS_LOWER = 12000;
  private static final double SMALL_PITS_UPPER = 20000;

  private RoadStateClassifier() {
  }

  public static RoadState classify(AccelerometerSample sample) {
    double z = sample.getZ();
    if (z > NORMAL_LOWER && z <= NORMAL_UPPER) {
      return RoadState.NORMAL;
    }
    if ((z > SMALL_PITS_LOWER && z < NORMAL_LOWER) || (z > NORMAL_UPPER && z < SMALL_PITS_UPPER)) {
      return RoadState.SMALL_PITS;
    }
    // NaN тоже сюда
    return RoadState.LARGE_PITS;
  }

  public static ProcessedRecord process(AgentRecord record) {
    return new ProcessedRecord(classify(record.getAccelerometer()), record);
  }
}
