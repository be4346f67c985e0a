package de.bycsitsm.dispatch.fieldservice;

import java.util.List;

/**
 * Typed access to the scheduling module of the external field-service platform.
 * Implementations are already authenticated and own timeouts; every failure is
 * reported as a {@link FieldServiceException}.
 */
public interface FieldServiceClient {

    List<ExternalTask> listTasks(TaskQuery query);

    List<ExternalTeam> listTeams();

    List<ExternalAdministrator> listAdministrators();
}
