package com.roadmonitor.service;

public class RecordNotFoundException extends RuntimeException {

  private final long id;

  public RecordNotFoundException(long id) {
    super("Data not found: " + id);
    this.id = id;
  }

  public long getId() {
    return id;
  }
}
