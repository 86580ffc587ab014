package taskhub.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void buildMinimalTask() {
        Task task = Task.builder()
                .collaborationId(7)
                .build();

        assertNull(task.id());
        assertFalse(task.isPersisted());
        assertEquals(7, task.collaborationId());
        assertEquals("", task.name());
        assertEquals("", task.description());
        assertEquals("", task.image());
        assertEquals("", task.input());
        assertEquals(Task.STATUS_OPEN, task.status());
    }

    @Test
    void toBuilderKeepsFields() {
        Instant now = Instant.now();
        Task draft = Task.builder()
                .collaborationId(1)
                .name("train")
                .description("epoch 1")
                .image("harbor/train:1")
                .input("{}")
                .createdAt(now)
                .build();

        Task saved = draft.toBuilder().id(42L).build();

        assertTrue(saved.isPersisted());
        assertEquals(42L, saved.id());
        assertEquals("train", saved.name());
        assertEquals("epoch 1", saved.description());
        assertEquals("harbor/train:1", saved.image());
        assertEquals("{}", saved.input());
        assertEquals(now, saved.createdAt());
        assertNotEquals(draft, saved);
    }

    @Test
    void collaborationRoomName() {
        Collaboration collaboration = new Collaboration(5, "c",
                List.of(new Node(1, "a", 5), new Node(2, "b", 5)));

        assertEquals("collaboration_5", collaboration.room());
        assertEquals(List.of(1L, 2L), collaboration.nodeIds());
    }

    @Test
    void taskResultFinishedOnceNodeReports() {
        TaskResult open = TaskResult.builder().taskId(1).nodeId(2).assignedAt(Instant.now()).build();
        TaskResult done = TaskResult.builder().taskId(1).nodeId(2).finishedAt(Instant.now()).result("ok").build();

        assertFalse(open.isFinished());
        assertTrue(done.isFinished());
    }
}
