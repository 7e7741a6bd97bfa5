package net.shelfsync.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 워커 프로세스. 피드 연동(PageSource / ApplyCollaborator / RecordSerializer) 빈을 등록하면
 * 해당 커서 태스크가 활성화된다.
 */
@SpringBootApplication
@EnableScheduling
public class ShelfsyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(ShelfsyncApplication.class, args);
    }
}
