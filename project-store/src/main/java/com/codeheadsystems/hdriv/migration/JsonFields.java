package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Typed reads of optional document fields. A missing field or an explicit null is empty; a
 * field of the wrong JSON type is an {@link InvalidFormatException}.
 */
public final class JsonFields {

  private JsonFields() {
  }

  private static Optional<JsonNode> field(final JsonNode parent, final String name) {
    final JsonNode node = parent.get(name);
    if (node == null || node.isNull()) {
      return Optional.empty();
    }
    return Optional.of(node);
  }

  private static InvalidFormatException wrongType(final String name, final String expected) {
    return new InvalidFormatException("Field '" + name + "' must be " + expected);
  }

  /**
   * Number optional double.
   *
   * @param parent the parent
   * @param name   the name
   * @return the optional double
   */
  public static OptionalDouble number(final JsonNode parent, final String name) {
    final Optional<JsonNode> node = field(parent, name);
    if (node.isEmpty()) {
      return OptionalDouble.empty();
    }
    if (!node.get().isNumber()) {
      throw wrongType(name, "a number");
    }
    return OptionalDouble.of(node.get().doubleValue());
  }

  public static Optional<String> text(final JsonNode parent, final String name) {
    final Optional<JsonNode> node = field(parent, name);
    if (node.isPresent() && !node.get().isTextual()) {
      throw wrongType(name, "a string");
    }
    return node.map(JsonNode::textValue);
  }

  public static Optional<Boolean> bool(final JsonNode parent, final String name) {
    final Optional<JsonNode> node = field(parent, name);
    if (node.isPresent() && !node.get().isBoolean()) {
      throw wrongType(name, "a boolean");
    }
    return node.map(JsonNode::booleanValue);
  }

  public static Optional<ObjectNode> object(final JsonNode parent, final String name) {
    final Optional<JsonNode> node = field(parent, name);
    if (node.isPresent() && !node.get().isObject()) {
      throw wrongType(name, "an object");
    }
    return node.map(ObjectNode.class::cast);
  }

  public static Optional<ArrayNode> array(final JsonNode parent, final String name) {
    final Optional<JsonNode> node = field(parent, name);
    if (node.isPresent() && !node.get().isArray()) {
      throw wrongType(name, "an array");
    }
    return node.map(ArrayNode.class::cast);
  }

  /**
   * Integer list.
   *
   * @param parent the parent
   * @param name   the name
   * @return the list, empty optional if absent
   */
  public static Optional<List<Integer>> integers(final JsonNode parent, final String name) {
    final Optional<ArrayNode> array = array(parent, name);
    if (array.isEmpty()) {
      return Optional.empty();
    }
    final List<Integer> result = new ArrayList<>();
    for (JsonNode element : array.get()) {
      if (!element.isIntegralNumber() || !element.canConvertToInt()) {
        throw wrongType(name, "an array of integers");
      }
      result.add(element.intValue());
    }
    return Optional.of(result);
  }

  /**
   * Required string field.
   *
   * @param parent the parent
   * @param name   the name
   * @return the string
   */
  public static String requireText(final JsonNode parent, final String name) {
    return text(parent, name)
        .orElseThrow(() -> new InvalidFormatException("Missing required field '" + name + "'"));
  }

  public static ObjectNode requireObject(final JsonNode parent, final String name) {
    return object(parent, name)
        .orElseThrow(() -> new InvalidFormatException("Missing required object '" + name + "'"));
  }

  public static ArrayNode requireArray(final JsonNode parent, final String name) {
    return array(parent, name)
        .orElseThrow(() -> new InvalidFormatException("Missing required array '" + name + "'"));
  }

}
