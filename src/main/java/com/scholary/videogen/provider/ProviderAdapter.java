package com.scholary.videogen.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Capability contract of one external video generation service.
 *
 * <p>Implementations are stateless apart from configuration and are shared by all worker threads.
 */
public interface ProviderAdapter {

  /** Registry key, matched exactly and case-sensitively. */
  String name();

  /** Supported model identifiers in declaration order. */
  List<String> supportedModels();

  /**
   * Validate and normalize parameters for a model.
   *
   * <p>Pure and deterministic: no I/O, and applying it to its own output returns an equal value.
   * The input is never mutated.
   *
   * @throws ParameterValidationException if the model is unknown or a required field is missing
   */
  ObjectNode validateParameters(String model, JsonNode parameters);

  /**
   * Run one generation to completion: validate, stage inputs, submit, poll, materialize outputs.
   *
   * @throws ParameterValidationException if the parameters are invalid
   * @throws ProviderCallException if staging, the remote call or polling fails
   */
  CanonicalResult call(String model, JsonNode parameters);
}
