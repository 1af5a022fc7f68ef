package dev.jobhunter.supervisor;

import dev.jobhunter.JobHunterApplication;
import dev.jobhunter.config.WorkerConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the command line used to start a worker process.
 * By default the current JVM relaunches this application in worker mode.
 */
@Component
@RequiredArgsConstructor
public class WorkerCommandFactory {

    public static final String WORKER_FLAG = "--analysis-worker";

    private final WorkerConfig workerConfig;

    public List<String> command() {
        if (workerConfig.getCommand() != null && !workerConfig.getCommand().isEmpty()) {
            return List.copyOf(workerConfig.getCommand());
        }

        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.addAll(workerConfig.getJavaOptions());

        String classPath = System.getProperty("java.class.path", "");
        if (isSingleJar(classPath)) {
            command.add("-jar");
            command.add(classPath);
        } else {
            command.add("-cp");
            command.add(classPath);
            command.add(JobHunterApplication.class.getName());
        }
        command.add(WORKER_FLAG);
        return List.copyOf(command);
    }

    private boolean isSingleJar(String classPath) {
        return !classPath.isBlank()
                && !classPath.contains(File.pathSeparator)
                && classPath.endsWith(".jar");
    }
}
