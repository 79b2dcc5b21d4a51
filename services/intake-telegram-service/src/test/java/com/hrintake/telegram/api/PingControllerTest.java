package com.hrintake.telegram.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.hrintake.telegram.polling.LoopState;
import com.hrintake.telegram.polling.TelegramPollingRunner;
import com.hrintake.telegram.store.DocumentStoreStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PingControllerTest {

  @Mock private ObjectProvider<TelegramPollingRunner> polling;
  @Mock private TelegramPollingRunner runner;
  @Mock private DocumentStoreStatus store;

  private MockMvc mvc() {
    return MockMvcBuilders.standaloneSetup(new PingController(polling, store))
        .setControllerAdvice(new ApiExceptionHandler())
        .build();
  }

  @Test
  void rootAnswersPlainText() throws Exception {
    mvc().perform(get("/")).andExpect(status().isOk()).andExpect(content().string("Bot is running!"));
  }

  @Test
  void pingReportsLoopAndStore() throws Exception {
    when(polling.getIfAvailable()).thenReturn(runner);
    when(runner.state()).thenReturn(LoopState.RUNNING);
    when(store.isAvailable()).thenReturn(false);

    mvc()
        .perform(get("/ping"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.polling").value("RUNNING"))
        .andExpect(jsonPath("$.store").value("unavailable"));
  }

  @Test
  void terminatedLoopIsDegraded() throws Exception {
    when(polling.getIfAvailable()).thenReturn(runner);
    when(runner.state()).thenReturn(LoopState.TERMINATED);
    when(store.isAvailable()).thenReturn(true);

    mvc()
        .perform(get("/ping"))
        .andExpect(jsonPath("$.status").value("degraded"))
        .andExpect(jsonPath("$.store").value("connected"));
  }

  @Test
  void disabledPollingIsReported() throws Exception {
    when(polling.getIfAvailable()).thenReturn(null);
    when(store.isAvailable()).thenReturn(true);

    mvc().perform(get("/ping")).andExpect(jsonPath("$.polling").value("DISABLED"));
  }

  @Test
  void unexpectedErrorsBecomeJson() throws Exception {
    when(polling.getIfAvailable()).thenThrow(new IllegalStateException("context closing"));

    mvc()
        .perform(get("/ping"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("context closing"));
  }
}
