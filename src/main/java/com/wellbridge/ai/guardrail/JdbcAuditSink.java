package com.wellbridge.ai.guardrail;

import org.springframework.jdbc.core.JdbcTemplate;

public class JdbcAuditSink implements AuditSink {

    private static final String INSERT = """
            INSERT INTO guardrail_violations (tenant_id, user_id, session_id, raw_response, pattern_matched)
            VALUES (?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcAuditSink(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void append(GuardrailViolation violation) {
        jdbcTemplate.update(INSERT,
                violation.tenantId(),
                violation.userId(),
                violation.sessionId(),
                violation.truncatedRawText(),
                violation.patternName());
    }
}
