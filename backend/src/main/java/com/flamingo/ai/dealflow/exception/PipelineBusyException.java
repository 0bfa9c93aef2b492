package com.flamingo.ai.dealflow.exception;

/** Exception thrown when a pipeline run is requested while another one is in progress. */
public class PipelineBusyException extends RuntimeException {

  public PipelineBusyException() {
    super("A pipeline run is already in progress");
  }

  public String getUserMessage() {
    return "A pipeline run is already in progress. Please try again later.";
  }
}
