package com.phillippitts.hybridfactor;

import com.phillippitts.hybridfactor.config.properties.FactorizationProperties;
import com.phillippitts.hybridfactor.service.orchestration.HybridFactorizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest
class HybridFactorApplicationTests {

    @Autowired
    private HybridFactorizer factorizer;

    @Autowired
    private FactorizationProperties props;

    @Autowired
    @Qualifier("factorWorkerExecutor")
    private Executor workerExecutor;

    @Test
    void contextLoads() {
        assertThat(factorizer).isNotNull();
        assertThat(workerExecutor).isInstanceOf(SimpleAsyncTaskExecutor.class);
    }

    @Test
    void bindsDefaultsFromApplicationProperties() {
        assertThat(props.getTrialLimit()).isEqualTo(1000);
        assertThat(props.getWorkerCount()).isEqualTo(4);
        assertThat(props.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.getPMinusOne().getMaxBound()).isEqualTo(100_000);
        assertThat(props.getRho().getBatchSize()).isEqualTo(64);
    }

    @Test
    void factorsThroughWiredBeans() {
        assertThat(factorizer.factorize(BigInteger.valueOf(21)).q()).isEqualTo(BigInteger.valueOf(7));
    }
}
