package com.wellbridge.ai.records;

import com.wellbridge.ai.agent.state.Appointment;
import com.wellbridge.ai.agent.state.PatientRecord;
import java.util.List;

/**
 * Read-only view of a patient's records and appointments, always scoped by tenant and user.
 * Implementations may throw unchecked data-access exceptions; callers degrade on them.
 */
public interface RecordStore {

    /** Most recent records first. */
    List<PatientRecord> findRecentRecords(String tenantId, String userId, int limit);

    /** Appointments from now on, soonest first. */
    List<Appointment> findUpcomingAppointments(String tenantId, String userId, int limit);

    /** Full-text search over note content, best match first. */
    List<NoteExcerpt> searchNotes(String tenantId, String userId, String query, int limit);
}
