package com.example.attendance.api;

public class InvalidAttendanceRequestException extends RuntimeException {

  public InvalidAttendanceRequestException(String message) {
    super(message);
  }
}
