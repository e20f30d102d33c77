package io.github.brokerbench.results;

/**
 * Thrown when there are no subscriber results to aggregate.
 */
public class EmptyAggregateInputException extends RuntimeException {

  public EmptyAggregateInputException(String message) {
    super(message);
  }
}
