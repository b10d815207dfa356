package droidreplay.device;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class BoundsTest {

    @Test
    public void parse_bracketedForm() {
        Bounds b = Bounds.parse("[100,200][300,400]");

        assertThat(b).isEqualTo(new Bounds(100, 200, 300, 400));
        assertThat(b.centerX()).isEqualTo(200);
        assertThat(b.centerY()).isEqualTo(300);
        assertThat(b.width()).isEqualTo(200);
    }

    @Test
    public void parse_flatFormWithSpaces() {
        assertThat(Bounds.parse(" 0, 10 ,20,30 ")).isEqualTo(new Bounds(0, 10, 20, 30));
    }

    @Test
    public void parse_returnsNullForGarbage() {
        assertThat(Bounds.parse(null)).isNull();
        assertThat(Bounds.parse("")).isNull();
        assertThat(Bounds.parse("[1,2][3]")).isNull();
        assertThat(Bounds.parse("left,top,right,bottom")).isNull();
        assertThat(Bounds.parse("[1,2][3,99999999999]")).isNull();
    }
}
