package com.wellbridge.ai.agent.node;

import com.wellbridge.ai.agent.graph.AgentNode;
import com.wellbridge.ai.agent.state.Appointment;
import com.wellbridge.ai.agent.state.NodeOutcome;
import com.wellbridge.ai.agent.state.TurnState;
import com.wellbridge.ai.records.RecordStore;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists upcoming appointments. Read-only and deterministic; no generation involved.
 */
public class CalendarNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(CalendarNode.class);

    static final int APPOINTMENT_LIMIT = 5;

    static final String NO_APPOINTMENTS =
            "You don't have any upcoming appointments on file. You can add one in the Calendar section.";

    static final String FAILURE_RESPONSE =
            "I couldn't load your appointments right now. Please try again in a moment.";

    private final RecordStore recordStore;

    public CalendarNode(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    @Override
    public NodeOutcome execute(TurnState state) {
        List<Appointment> appointments;
        try {
            appointments = recordStore.findUpcomingAppointments(state.tenantId(), state.userId(), APPOINTMENT_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Appointment fetch failed session={}", state.sessionId(), e);
            return NodeOutcome.builder()
                    .toolError(e.getMessage())
                    .rawResponse(FAILURE_RESPONSE)
                    .build();
        }

        if (appointments.isEmpty()) {
            return NodeOutcome.builder()
                    .appointments(appointments)
                    .rawResponse(NO_APPOINTMENTS)
                    .build();
        }

        String listing = appointments.stream()
                .map(CalendarNode::describe)
                .collect(Collectors.joining("\n"));
        String noun = appointments.size() == 1 ? "appointment" : "appointments";

        return NodeOutcome.builder()
                .appointments(appointments)
                .rawResponse("You have " + appointments.size() + " upcoming " + noun + ":\n" + listing)
                .build();
    }

    static String describe(Appointment appointment) {
        StringBuilder line = new StringBuilder("• ")
                .append(appointment.dateText())
                .append(" - ")
                .append(appointment.providerOr("Your care team"));
        if (appointment.facilityName() != null && !appointment.facilityName().isBlank()) {
            line.append(" at ").append(appointment.facilityName());
        }
        return line.toString();
    }
}
