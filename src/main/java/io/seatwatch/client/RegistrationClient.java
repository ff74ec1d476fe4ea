package io.seatwatch.client;

import java.util.List;

/**
 * Remote registration service, bound to one tenant's session credential. Implementations own
 * the wire protocol; the orchestrator only sees these three calls.
 */
public interface RegistrationClient {

    List<SectionStatus> getSectionStatus(String term, String department, String courseCode);

    boolean submitAction(String term, String sectionId);

    boolean checkSession(String term);
}
