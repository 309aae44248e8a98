package io.github.shiftlog.workforce;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@MapperScan("io.github.shiftlog.workforce.infrastructure.mapper")
public class WorkforceApplication {

	public static void main(String[] args) {
		SpringApplication.run(WorkforceApplication.class, args);
	}

}
