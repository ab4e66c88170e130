package com.debateleague.pairing.model;

public enum AttendanceStatus {
  PRESENT,
  ABSENT,
  UNKNOWN
}
