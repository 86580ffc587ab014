package taskhub.coordinator.repository;

import taskhub.coordinator.model.Collaboration;

import java.util.Optional;

/**
 * Read-only view of collaborations and their member nodes.
 */
public interface CollaborationRepository {

    /**
     * Resolve a collaboration and snapshot its current member nodes.
     *
     * @param collaborationId the collaboration ID
     * @return the collaboration with its nodes, ordered by node ID
     */
    Optional<Collaboration> findById(long collaborationId);

    /**
     * Count all collaborations.
     */
    int count();
}
