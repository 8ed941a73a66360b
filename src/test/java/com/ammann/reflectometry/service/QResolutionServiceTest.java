/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.model.MomentumTransfer;
import com.ammann.reflectometry.model.SlitData;
import com.ammann.reflectometry.support.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QResolutionServiceTest
{

    private final QResolutionService service = new QResolutionService();

    @Test
    void momentumTransferFollowsBraggGeometry()
    {
        double q = service.momentumTransfer(1.0, 4.66);

        assertThat(q).isCloseTo(4 * Math.PI / 4.66 * Math.sin(Math.toRadians(1.0)), within(1e-12));
    }

    @Test
    void angularDivergenceUsesSlitSeparation()
    {
        SlitData slits = new SlitData(1.0, 0.5, -2000.0, -200.0);

        assertThat(service.angularDivergence(slits)).isCloseTo(1.5 / 3600.0, within(1e-15));
    }

    @Test
    void resolutionApproachesWavelengthSpreadAtLargeAngles()
    {
        double resolution = service.relativeResolution(89.0, TestDataFactory.slits(), 0.05);

        assertThat(resolution).isCloseTo(0.05, within(1e-4));
    }

    @Test
    void calculateCombinesWavelengthAndAngularContributions()
    {
        double[] angles = {0.5, 1.0, 2.0};

        MomentumTransfer result = service.calculate(angles, 4.66, TestDataFactory.slits(), 0.05);

        double divergence = 1.5 / 3600.0;
        for (int i = 0; i < angles.length; i++) {
            double theta = Math.toRadians(angles[i]);
            double q = 4 * Math.PI / 4.66 * Math.sin(theta);
            double relative = Math.sqrt(0.05 * 0.05 + Math.pow(divergence / Math.tan(theta), 2));
            assertThat(result.q()[i]).isCloseTo(q, within(1e-12));
            assertThat(result.dq()[i]).isCloseTo(q * relative, within(1e-12));
        }
    }

    @Test
    void resolutionDecreasesWithAngle()
    {
        double low = service.relativeResolution(0.2, TestDataFactory.slits(), 0.05);
        double high = service.relativeResolution(2.0, TestDataFactory.slits(), 0.05);

        assertThat(low).isGreaterThan(high);
    }
}
