package dev.jobhunter;

import dev.jobhunter.supervisor.WorkerCommandFactory;
import dev.jobhunter.worker.AnalysisWorker;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Arrays;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobHunterApplication {

    public static void main(String[] args) {
        // Worker processes are relaunches of this jar and never start the Spring context
        if (Arrays.asList(args).contains(WorkerCommandFactory.WORKER_FLAG)) {
            System.exit(AnalysisWorker.run(System.getenv()));
        }
        SpringApplication.run(JobHunterApplication.class, args);
    }
}
