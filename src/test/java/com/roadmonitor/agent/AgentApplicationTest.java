package com.roadmonitor.agent;

import com.roadmonitor.forwarder.BufferedForwarder;
import com.roadmonitor.forwarder.PermanentRejectionException;
import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.RoadState;
import com.roadmonitor.model.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static org.mockito.Mockito.*;

class AgentApplicationTest {

  @Mock
  private SampleSource source;

  @Mock
  private BufferedForwarder forwarder;

  private AgentApplication agent;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    agent = new AgentApplication(source, forwarder);
  }

  @Test
  @DisplayName("Шаг агента классифицирует замер и кладёт его в буфер")
  void shouldClassifyAndEnqueue() throws Exception {
    when(source.next()).thenReturn(TestRecords.agent(4, 19000));
    when(forwarder.enqueue(any())).thenReturn(true);

    boolean accepted = agent.step();

    ArgumentCaptor<ProcessedRecord> captor = ArgumentCaptor.forClass(ProcessedRecord.class);
    verify(forwarder).enqueue(captor.capture());
    assertThat(accepted).isTrue();
    assertThat(captor.getValue().getRoadState()).isEqualTo(RoadState.SMALL_PITS);
    assertThat(captor.getValue().getAgentData().getUserId()).isEqualTo(4);
  }

  @Test
  @DisplayName("Отказ сервиса в цикле агента сбрасывает отклонённые записи, цикл продолжается")
  void shouldDiscardPendingOnRejectionAndKeepRunning() throws Exception {
    when(source.next()).thenReturn(TestRecords.agent(1, 15000));
    when(forwarder.enqueue(any()))
        .thenThrow(new PermanentRejectionException(422, "{\"error\":\"bad\"}"))
        .thenReturn(true);
    when(forwarder.discardPending()).thenReturn(List.of());

    ScheduledExecutorService scheduler = agent.start(10);
    try {
      verify(source).open();
      verify(forwarder, timeout(2000)).discardPending();
      verify(forwarder, timeout(2000).atLeast(3)).enqueue(any());
    } finally {
      agent.stop(scheduler);
    }
  }

  @Test
  @DisplayName("Непредвиденная ошибка шага не останавливает расписание")
  void shouldKeepRunningAfterRuntimeException() throws Exception {
    when(source.next())
        .thenThrow(new IllegalStateException("acc.csv:3: некорректное число"))
        .thenReturn(TestRecords.agent(1, 15000));
    when(forwarder.enqueue(any())).thenReturn(true);

    ScheduledExecutorService scheduler = agent.start(10);
    try {
      verify(forwarder, timeout(2000).atLeast(2)).enqueue(any());
      verify(forwarder, never()).discardPending();
    } finally {
      agent.stop(scheduler);
    }
  }

  @Test
  @DisplayName("stop() выполняет финальную отправку и закрывает источник")
  void shouldFlushAndCloseSourceOnStop() throws Exception {
    when(source.next()).thenReturn(TestRecords.agent(1, 15000));
    when(forwarder.enqueue(any())).thenReturn(true);

    ScheduledExecutorService scheduler = agent.start(10);
    agent.stop(scheduler);

    assertThat(scheduler.isShutdown()).isTrue();
    verify(forwarder).close();
    verify(source).close();
  }

  @Test
  @DisplayName("Источник закрывается, даже если финальный пакет отклонён")
  void shouldCloseSourceWhenFinalFlushRejected() throws Exception {
    when(source.next()).thenReturn(TestRecords.agent(1, 15000));
    when(forwarder.enqueue(any())).thenReturn(true);
    doThrow(new PermanentRejectionException(400, "bad")).when(forwarder).close();

    ScheduledExecutorService scheduler = agent.start(10);
    agent.stop(scheduler);

    verify(forwarder).close();
    verify(source).close();
  }
}
