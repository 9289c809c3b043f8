package com.wellbridge.ai.agent.node;

import static org.junit.jupiter.api.Assertions.*;

import com.wellbridge.ai.agent.state.Appointment;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.support.FakeRecordStore;
import com.wellbridge.ai.support.TurnStates;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

public class CalendarNodeTest {

  private static Appointment appointment(int day, String provider, String facility) {
    return new Appointment(provider, facility, OffsetDateTime.of(2025, 6, day, 9, 30, 0, 0, ZoneOffset.UTC), 30, null);
  }

  @Test
  void listsUpcomingAppointments() {
    FakeRecordStore store = new FakeRecordStore()
        .appointment(appointment(2, "Dr. Lee", "Riverside Clinic"))
        .appointment(appointment(9, null, " "));

    NodeOutcome outcome = new CalendarNode(store).execute(TurnStates.of("when is my next appointment?"));

    assertEquals("You have 2 upcoming appointments:\n"
        + "• 2025-06-02 - Dr. Lee at Riverside Clinic\n"
        + "• 2025-06-09 - Your care team", outcome.rawResponse());
  }

  @Test
  void singleAppointment() {
    FakeRecordStore store = new FakeRecordStore().appointment(appointment(2, "Dr. Lee", null));

    NodeOutcome outcome = new CalendarNode(store).execute(TurnStates.of("any appointments?"));

    assertTrue(outcome.rawResponse().startsWith("You have 1 upcoming appointment:\n"));
  }

  @Test
  void noAppointments() {
    NodeOutcome outcome = new CalendarNode(new FakeRecordStore()).execute(TurnStates.of("any appointments?"));

    assertEquals(CalendarNode.NO_APPOINTMENTS, outcome.rawResponse());
    assertNull(outcome.toolError());
  }

  @Test
  void storeFailure() {
    NodeOutcome outcome = new CalendarNode(new FakeRecordStore().failing()).execute(TurnStates.of("any appointments?"));

    assertEquals(CalendarNode.FAILURE_RESPONSE, outcome.rawResponse());
    assertNotNull(outcome.toolError());
  }
}
