package io.rtpi.workspace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

@SpringBootApplication
@EnableScheduling
public class RtpiWorkspaceApplication {

    public static void main(String[] args) {
        // expires_at / terminated_at 等字段都是 LocalDateTime（无时区），进程时区必须固定。
        // 默认 UTC，可通过 RTPI_TZ 或 -Duser.timezone 覆盖。
        String tz = System.getProperty("user.timezone");
        if (tz == null || tz.isBlank()) {
            tz = System.getenv("RTPI_TZ");
        }
        if (tz == null || tz.isBlank()) {
            tz = "UTC";
        }
        TimeZone.setDefault(TimeZone.getTimeZone(tz));
        System.setProperty("user.timezone", tz);
        SpringApplication.run(RtpiWorkspaceApplication.class, args);
    }
}
