package com.phillippitts.hybridfactor.service.worker;

import com.phillippitts.hybridfactor.config.properties.FactorizationProperties;
import com.phillippitts.hybridfactor.service.race.RaceContext;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Builds racing workers from the configured algorithm parameters.
 *
 * <p>Not final so tests can substitute workers with scripted behavior.
 */
@Component
public class FactorWorkerFactory {

    private final FactorizationProperties props;

    public FactorWorkerFactory(FactorizationProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public AbstractFactorWorker pMinusOne(String workerId, RaceContext race) {
        FactorizationProperties.PMinusOne cfg = props.getPMinusOne();
        PMinusOneParameters params = new PMinusOneParameters(
                cfg.getBaselineBound(), cfg.getMaxBound(), cfg.getEscalationFactor(), cfg.getBatchSize());
        return new PollardPMinusOneWorker(workerId, race, params);
    }

    /**
     * Builds the rho worker for {@code seed}; distinct seeds give distinct constants.
     */
    public AbstractFactorWorker rho(String workerId, RaceContext race, long seed) {
        FactorizationProperties.Rho cfg = props.getRho();
        RhoParameters params = RhoParameters.forSeed(seed, race.n(),
                BigInteger.valueOf(cfg.getStartValue()), cfg.getMaxIterations(), cfg.getBatchSize());
        return new PollardRhoWorker(workerId, race, params);
    }
}
