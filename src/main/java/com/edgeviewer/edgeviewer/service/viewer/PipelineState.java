package com.edgeviewer.edgeviewer.service.viewer;

public enum PipelineState {
    IDLE,
    CAPTURING,
    // initialization failed; left only through an explicit start
    UNAVAILABLE
}
