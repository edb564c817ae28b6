package com.trackradar.radar.model;

public enum AlarmKind {
    OFF_TRACK,
    SIGNAL_LOST,
    POSITIVE_ACKNOWLEDGEMENT
}
