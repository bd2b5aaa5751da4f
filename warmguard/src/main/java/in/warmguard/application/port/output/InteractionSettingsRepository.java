package in.warmguard.application.port.output;

import in.warmguard.domain.engagement.InteractionSettings;

import java.util.Optional;

/**
 * Read access to per-project interaction settings.
 */
public interface InteractionSettingsRepository {

    Optional<InteractionSettings> findByProjectId(long projectId);
}
