package com.di.segmerge;

import com.di.segmerge.config.MergeJobProperties;
import com.di.segmerge.runner.MergeJobRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SegMergeApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(SegMergeApplication.class, args);
		MergeJobProperties jobProps = ctx.getBean(MergeJobProperties.class);
		// Without a configured job the context only hosts the services for embedding callers.
		if (jobProps.isEnabled()) {
			ctx.getBean(MergeJobRunner.class).runJob();
		}
	}
}
