package com.wellbridge.ai.records;

import com.wellbridge.ai.agent.state.Appointment;
import com.wellbridge.ai.agent.state.PatientRecord;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

public class JdbcRecordStore implements RecordStore {

    private static final String RECENT_RECORDS = """
            SELECT id, record_type, provider_name, facility_name, note_date, content
            FROM patient_records
            WHERE tenant_id = ? AND patient_user_id = ?
            ORDER BY note_date DESC NULLS LAST
            LIMIT ?
            """;

    private static final String UPCOMING_APPOINTMENTS = """
            SELECT provider_name, facility_name, appointment_date, duration_minutes, notes
            FROM appointments
            WHERE tenant_id = ? AND patient_user_id = ? AND appointment_date >= now()
            ORDER BY appointment_date
            LIMIT ?
            """;

    private static final String SEARCH_NOTES = """
            SELECT id, provider_name, note_date,
                   ts_headline('english', content, plainto_tsquery('english', ?),
                               'MaxWords=40, MinWords=15') AS relevant_excerpt
            FROM patient_records
            WHERE tenant_id = ? AND patient_user_id = ?
              AND to_tsvector('english', content) @@ plainto_tsquery('english', ?)
            ORDER BY ts_rank(to_tsvector('english', content), plainto_tsquery('english', ?)) DESC
            LIMIT ?
            """;

    private static final RowMapper<PatientRecord> RECORD_MAPPER = (rs, rowNum) -> new PatientRecord(
            rs.getString("id"),
            rs.getString("record_type"),
            rs.getString("provider_name"),
            rs.getString("facility_name"),
            localDate(rs, "note_date"),
            rs.getString("content"));

    private static final RowMapper<Appointment> APPOINTMENT_MAPPER = (rs, rowNum) -> new Appointment(
            rs.getString("provider_name"),
            rs.getString("facility_name"),
            rs.getObject("appointment_date", OffsetDateTime.class),
            (Integer) rs.getObject("duration_minutes"),
            rs.getString("notes"));

    private static final RowMapper<NoteExcerpt> EXCERPT_MAPPER = (rs, rowNum) -> new NoteExcerpt(
            rs.getString("id"),
            rs.getString("provider_name"),
            localDate(rs, "note_date"),
            rs.getString("relevant_excerpt"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcRecordStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<PatientRecord> findRecentRecords(String tenantId, String userId, int limit) {
        return jdbcTemplate.query(RECENT_RECORDS, RECORD_MAPPER, tenantId, userId, limit);
    }

    @Override
    public List<Appointment> findUpcomingAppointments(String tenantId, String userId, int limit) {
        return jdbcTemplate.query(UPCOMING_APPOINTMENTS, APPOINTMENT_MAPPER, tenantId, userId, limit);
    }

    @Override
    public List<NoteExcerpt> searchNotes(String tenantId, String userId, String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return jdbcTemplate.query(SEARCH_NOTES, EXCERPT_MAPPER, query, tenantId, userId, query, query, limit);
    }

    private static LocalDate localDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date == null ? null : date.toLocalDate();
    }
}
