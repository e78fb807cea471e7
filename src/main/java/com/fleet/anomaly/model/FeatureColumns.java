package com.fleet.anomaly.model;

import java.util.List;

/**
 * Column names of the feature table that the detection engine reads or writes directly.
 * Statistical and ML feature lists are configurable and not listed here.
 */
public final class FeatureColumns {

    private FeatureColumns() {}

    // Inputs read by the threshold rules
    public static final String TEMP_MOTOR_MAX = "temp_motor1_1_max";
    public static final String TEMP_MOTOR_RATE = "temp_motor1_1_rate";
    public static final String CURRENT_STD = "current_u_std";
    public static final String BATTERY_VOLT_MIN = "battery_volt_min";
    public static final String AVG_SPEED = "avg_speed";
    public static final String PRESSURE_MIN = "pressure_tr1_min";

    // Movement fraction used to select intervals for the ML layer
    public static final String PCT_MOVING = "pct_moving";

    public static final List<String> RULE_INPUTS = List.of(
            TEMP_MOTOR_MAX, TEMP_MOTOR_RATE, CURRENT_STD, BATTERY_VOLT_MIN, AVG_SPEED, PRESSURE_MIN);

    // Columns appended to the output table, in output order
    public static final String SPEED_CHANGE = "speed_change";
    public static final String FLAG_RULE = "flag_rule";
    public static final String FLAG_MAD = "flag_mad";
    public static final String FLAG_ML = "flag_ml";
    public static final String TAGS = "tags";
    public static final String SCORE = "score";
    public static final String IS_ANOMALY = "is_anomaly";

    public static final List<String> OUTPUT_COLUMNS = List.of(
            SPEED_CHANGE, FLAG_RULE, FLAG_MAD, FLAG_ML, TAGS, SCORE, IS_ANOMALY);
}
