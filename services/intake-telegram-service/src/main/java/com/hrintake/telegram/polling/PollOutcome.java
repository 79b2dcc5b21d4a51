package com.hrintake.telegram.polling;

import java.time.Duration;

/** Итог одного опроса: продолжить (возможно после паузы) или остановиться. */
record PollOutcome(boolean fatal, Duration pause) {

  static PollOutcome proceed() {
    return new PollOutcome(false, Duration.ZERO);
  }

  static PollOutcome retryAfter(Duration pause) {
    return new PollOutcome(false, pause);
  }

  static PollOutcome stop() {
    return new PollOutcome(true, Duration.ZERO);
  }
}
