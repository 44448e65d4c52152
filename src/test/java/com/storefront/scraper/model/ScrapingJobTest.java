package com.storefront.scraper.model;

import com.storefront.scraper.enums.JobPriority;
import com.storefront.scraper.enums.JobStatus;
import com.storefront.scraper.enums.Platform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScrapingJob Tests")
class ScrapingJobTest {

    @Test
    @DisplayName("forUrl_appliesDefaults")
    void forUrl_appliesDefaults() {
        ScrapingJob job = ScrapingJob.forUrl("https://www.amazon.com/dp/B0001", Platform.AMAZON);

        assertThat(job.getId()).matches("job_[0-9a-f]{16}");
        assertThat(job.getPriority()).isEqualTo(JobPriority.MEDIUM);
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getMaxRetries()).isEqualTo(3);
        assertThat(job.getRetryCount()).isZero();
        assertThat(job.target()).isEqualTo("https://www.amazon.com/dp/B0001");
    }

    @Test
    @DisplayName("target_queryOnly_buildsEncodedSearchUrl")
    void target_queryOnly_buildsEncodedSearchUrl() {
        ScrapingJob job = ScrapingJob.builder().query(" bluetooth & usb ").platform(Platform.ALIEXPRESS).build();

        assertThat(job.target()).isEqualTo("https://www.aliexpress.com/wholesale?SearchText=bluetooth+%26+usb");
    }

    @Test
    @DisplayName("target_neither_throwsIllegalState")
    void target_neither_throwsIllegalState() {
        ScrapingJob job = ScrapingJob.builder().id("job_1").platform(Platform.AMAZON).build();

        assertThatThrownBy(job::target).isInstanceOf(IllegalStateException.class).hasMessageContaining("job_1");
    }

    @Test
    @DisplayName("priority_downgradeStopsAtLow")
    void priority_downgradeStopsAtLow() {
        assertThat(JobPriority.HIGH.downgrade()).isEqualTo(JobPriority.MEDIUM);
        assertThat(JobPriority.MEDIUM.downgrade()).isEqualTo(JobPriority.LOW);
        assertThat(JobPriority.LOW.downgrade()).isEqualTo(JobPriority.LOW);
        assertThat(JobPriority.fromCode("high")).isEqualTo(JobPriority.HIGH);
    }
}
