package org.idfnexus.geometry.mesh;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TubeMeshFactoryTest {

    /**
     * 两根沿 z 的圆柱：半径 1 高 2 在原点，半径 0.5 高 1 在 x = 10。
     */
    private static final CylindricalMesh TWO_TUBES = new CylindricalMesh(new double[]{
            0, 0, 0, 1, 0, 0, 0, 0, 2,
            10, 0, 0, 10.5, 0, 0, 10, 0, 1
    }, new int[]{0, 1, 2, 3, 4, 5});

    @Test
    void tessellate_ringsAndSideFaces() {
        Mesh mesh = TubeMeshFactory.tessellate(TWO_TUBES, 6);

        assertThat(mesh.vertexCount()).isEqualTo(2 * 12);
        assertThat(mesh.faceCount()).isEqualTo(2 * 6);
        assertThat(mesh.face(0)).containsExactly(0, 6, 7, 1);
        // 最后一个侧面回绕到第一个点
        assertThat(mesh.face(5)).containsExactly(5, 11, 6, 0);
        assertThat(mesh.face(6)).containsExactly(12, 18, 19, 13);
    }

    @Test
    void tessellate_keepsRadiusAndHeight() {
        Mesh mesh = TubeMeshFactory.tessellate(TWO_TUBES, 8);

        for (int k = 0; k < 8; k++) {
            Vector3D bottom = mesh.vertex(k);
            Vector3D top = mesh.vertex(8 + k);
            assertThat(Math.hypot(bottom.getX(), bottom.getY())).isCloseTo(1.0, within(1e-12));
            assertThat(bottom.getZ()).isCloseTo(0.0, within(1e-12));
            assertThat(top.getZ()).isCloseTo(2.0, within(1e-12));
            assertThat(top.getX()).isCloseTo(bottom.getX(), within(1e-12));
        }
        Vector3D second = mesh.vertex(16);
        assertThat(second).isEqualTo(new Vector3D(10.5, 0, 0));
        assertThat(mesh.vertex(16 + 4).distance(new Vector3D(9.5, 0, 0))).isLessThan(1e-12);
    }

    @Test
    void tessellate_rejectsTooFewPointsAndFlatCylinders() {
        assertThatThrownBy(() -> TubeMeshFactory.tessellate(TWO_TUBES, 2))
                .isInstanceOf(IllegalArgumentException.class);
        CylindricalMesh flat = new CylindricalMesh(new double[]{0, 0, 0, 1, 0, 0, 0, 0, 0}, new int[]{0, 1, 2});
        assertThatThrownBy(() -> TubeMeshFactory.tessellate(flat, 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("高度为 0");
    }
}
