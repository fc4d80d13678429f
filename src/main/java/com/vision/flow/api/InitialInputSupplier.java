package com.vision.flow.api;

import com.vision.flow.model.PortValue;

import java.util.Map;

/**
 * Supplies the root values a run starts with, typically the captured image.
 *
 * Keys are either a bare input port name or {@code "<nodeId>.<port>"} to target
 * one node.
 */
@FunctionalInterface
public interface InitialInputSupplier {

    Map<String, PortValue> supply() throws Exception;
}
