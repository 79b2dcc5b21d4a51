package com.hrintake.telegram.polling;

public enum LoopState {
  NEW,
  RUNNING,
  SHUTTING_DOWN,
  TERMINATED
}
