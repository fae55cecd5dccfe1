package sp.sistemaspalacios.api_checkpoint;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import sp.sistemaspalacios.api_checkpoint.service.face.FaceComparisonClient;
import sp.sistemaspalacios.api_checkpoint.service.face.FacePlusPlusClient;
import sp.sistemaspalacios.api_checkpoint.service.reconciliation.ReconciliationScheduler;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ApiCheckpointApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoadsWithProviderClientAndWithoutScheduler() {
        assertThat(context.getBean(FaceComparisonClient.class)).isInstanceOf(FacePlusPlusClient.class);
        assertThat(context.getBeansOfType(ReconciliationScheduler.class)).isEmpty();
    }
}
