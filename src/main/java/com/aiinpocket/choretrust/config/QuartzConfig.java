package com.aiinpocket.choretrust.config;

import com.aiinpocket.choretrust.job.AssignmentExpiryJob;
import com.aiinpocket.choretrust.job.CredibilityDecayJob;
import org.quartz.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QuartzConfig {

    // CredibilityDecayJob：每日凌晨返還 30/60 天前的扣分，並結束過期的救贖加成
    @Bean
    public JobDetail credibilityDecayJobDetail() {
        return JobBuilder.newJob(CredibilityDecayJob.class)
                .withIdentity("credibilityDecayJob", "chore-trust")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger credibilityDecayTrigger(JobDetail credibilityDecayJobDetail, ChoreTrustProperties props) {
        return TriggerBuilder.newTrigger()
                .forJob(credibilityDecayJobDetail)
                .withIdentity("credibilityDecayTrigger", "chore-trust")
                .withSchedule(CronScheduleBuilder.cronSchedule(props.jobs().decayCron()))
                .build();
    }

    // AssignmentExpiryJob：將超過期限仍未完成的任務標記為過期
    @Bean
    public JobDetail assignmentExpiryJobDetail() {
        return JobBuilder.newJob(AssignmentExpiryJob.class)
                .withIdentity("assignmentExpiryJob", "chore-trust")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger assignmentExpiryTrigger(JobDetail assignmentExpiryJobDetail, ChoreTrustProperties props) {
        return TriggerBuilder.newTrigger()
                .forJob(assignmentExpiryJobDetail)
                .withIdentity("assignmentExpiryTrigger", "chore-trust")
                .withSchedule(CronScheduleBuilder.cronSchedule(props.jobs().expiryCron()))
                .build();
    }
}
