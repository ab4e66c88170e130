package com.debateleague.pairing.engine;

public class ResourceShortageException extends PairingEngineException {

  private final String resource;
  private final int required;
  private final int available;

  public ResourceShortageException(String resource, int required, int available) {
    super(
        "not enough "
            + resource
            + ": required="
            + required
            + " available="
            + available
            + " shortfall="
            + (required - available));
    this.resource = resource;
    this.required = required;
    this.available = available;
  }

  public String resource() {
    return resource;
  }

  public int required() {
    return required;
  }

  public int available() {
    return available;
  }

  public int shortfall() {
    return required - available;
  }
}
