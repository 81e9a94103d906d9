package com.yerin.notifyq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

// Redis 연결은 QueueConfig 가 연결 문자열이 있을 때만 만든다.
@SpringBootApplication(exclude = RedisAutoConfiguration.class)
@EnableScheduling
public class NotifyqApplication {

	public static void main(String[] args) {
		SpringApplication.run(NotifyqApplication.class, args);
	}

}
