package com.trade.foresight.pipeline;

import com.trade.foresight.pipeline.runner.LaunchArgs;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ForesightApplication {

	public static void main(String[] args) {
		// picked up by logback-spring.xml for the per-process log file
		System.setProperty("foresight.process", LaunchArgs.parse(args).processName());
		ConfigurableApplicationContext ctx = SpringApplication.run(ForesightApplication.class, args);
		System.exit(SpringApplication.exit(ctx));
	}

}
