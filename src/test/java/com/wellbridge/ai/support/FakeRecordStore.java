package com.wellbridge.ai.support;

import com.wellbridge.ai.agent.state.Appointment;
import com.wellbridge.ai.agent.state.PatientRecord;
import com.wellbridge.ai.records.NoteExcerpt;
import com.wellbridge.ai.records.RecordStore;
import java.util.ArrayList;
import java.util.List;
import org.springframework.dao.DataAccessResourceFailureException;

public class FakeRecordStore implements RecordStore {

  private final List<PatientRecord> records = new ArrayList<>();
  private final List<Appointment> appointments = new ArrayList<>();
  private final List<NoteExcerpt> excerpts = new ArrayList<>();
  private final List<String> queriedUsers = new ArrayList<>();
  private boolean failing;

  public FakeRecordStore record(PatientRecord record) {
    records.add(record);
    return this;
  }

  public FakeRecordStore appointment(Appointment appointment) {
    appointments.add(appointment);
    return this;
  }

  public FakeRecordStore excerpt(NoteExcerpt excerpt) {
    excerpts.add(excerpt);
    return this;
  }

  public FakeRecordStore failing() {
    this.failing = true;
    return this;
  }

  public List<String> queriedUsers() {
    return List.copyOf(queriedUsers);
  }

  @Override
  public List<PatientRecord> findRecentRecords(String tenantId, String userId, int limit) {
    check(tenantId, userId);
    return List.copyOf(records.subList(0, Math.min(limit, records.size())));
  }

  @Override
  public List<Appointment> findUpcomingAppointments(String tenantId, String userId, int limit) {
    check(tenantId, userId);
    return List.copyOf(appointments.subList(0, Math.min(limit, appointments.size())));
  }

  @Override
  public List<NoteExcerpt> searchNotes(String tenantId, String userId, String query, int limit) {
    check(tenantId, userId);
    return List.copyOf(excerpts.subList(0, Math.min(limit, excerpts.size())));
  }

  private void check(String tenantId, String userId) {
    queriedUsers.add(tenantId + "/" + userId);
    if (failing) {
      throw new DataAccessResourceFailureException("record store unavailable");
    }
  }
}
