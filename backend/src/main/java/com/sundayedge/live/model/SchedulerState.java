package com.sundayedge.live.model;

public enum SchedulerState {
  IDLE,
  RUNNING
}
