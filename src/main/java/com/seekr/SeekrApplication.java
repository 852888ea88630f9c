package com.seekr;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * @author seekr
 */
@SpringBootApplication
@EnableScheduling
@MapperScan("com.seekr.mapper")
public class SeekrApplication {

	public static void main(String[] args) {
		SpringApplication.run(SeekrApplication.class, args);
	}

}
