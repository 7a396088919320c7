package provisio.coordinator.scheduler;

import provisio.coordinator.model.Task;
import provisio.coordinator.model.TaskStatus;
import provisio.coordinator.repository.TaskRepository;
import provisio.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background task that fails RUNNING tasks past their deadline.
 *
 * A timed-out task frees its node slot and its reservation. The remote
 * operation may still finish later; its result is then ignored.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final TaskRepository taskRepository;
    private final TaskService taskService;
    private final Clock clock;

    public TaskReaper(TaskRepository taskRepository, TaskService taskService, Clock clock) {
        this.taskRepository = taskRepository;
        this.taskService = taskService;
        this.clock = clock;
    }

    @Override
    public void run() {
        reapTimedOut();
    }

    /**
     * @return number of tasks timed out
     */
    public int reapTimedOut() {
        Instant now = clock.instant();
        List<Task> runningTasks = taskRepository.findByStatus(TaskStatus.RUNNING);

        int reaped = 0;
        for (Task task : runningTasks) {
            Instant deadline = task.deadline();
            if (deadline == null || !deadline.isBefore(now)) {
                continue;
            }
            try {
                if (taskService.timeOut(task.id())) {
                    reaped++;
                }
            } catch (Exception e) {
                log.error("Failed to time out task {}", task.id(), e);
            }
        }

        if (reaped > 0) {
            log.info("Task reaper: {} of {} running tasks timed out", reaped, runningTasks.size());
        } else {
            log.debug("Task reaper: no timed-out tasks among {} running", runningTasks.size());
        }
        return reaped;
    }
}
