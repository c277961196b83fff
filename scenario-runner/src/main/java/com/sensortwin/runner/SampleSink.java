package com.sensortwin.runner;

import com.sensortwin.core.model.LabeledSample;

import java.io.IOException;

/**
 * Receives labeled samples in emission order.
 */
@FunctionalInterface
public interface SampleSink {

    void accept(LabeledSample sample) throws IOException;
}
