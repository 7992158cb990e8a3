package com.scout.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Scout entry point.
 *
 * <pre>
 *   scout [--instance=&lt;dir&gt;]                      run the daemon
 *   scout [--instance=&lt;dir&gt;] --run-now=&lt;name&gt;    fire one schedule and wait
 *   scout [--instance=&lt;dir&gt;] send --transport=telegram|log [--to=&lt;id&gt;] --message=&lt;text&gt;
 * </pre>
 */
@SpringBootApplication
public class ScoutApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ScoutApplication.class, args);
        if (context.getBean(ScoutCommandRunner.class).isOneShot()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
