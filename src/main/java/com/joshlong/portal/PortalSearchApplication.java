package com.joshlong.portal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(PortalProperties.class)
@SpringBootApplication
public class PortalSearchApplication {

	public static void main(String[] args) {
		// the commands are one-shot, so we exit once the runners are done
		System.exit(SpringApplication.exit(SpringApplication.run(PortalSearchApplication.class, args)));
	}

}
