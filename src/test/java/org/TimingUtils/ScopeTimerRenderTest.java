/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.TimingUtils;

import org.junit.Assert;
import org.junit.Test;

/**
 * JUnit test for the textual rendering of {@link org.TimingUtils.ScopeTimer} trees
 */
public class ScopeTimerRenderTest {

    static {
        System.setProperty("TimingUtils.useActualTime", "false");
    }

    @Test
    public void testNestedTreeRendering() throws Exception {
        ScopeTimer root = new ScopeTimer("root", 10);
        try (ScopeTimer r = root.enter()) {
            for (int i = 1; i <= 3; i++) {
                try (ScopeTimer task1 = root.getOrCreateChild("task1", 5).enter()) {
                    TimeServices.moveTimeForwardMsec(10 * i);
                    if (i == 3) {
                        try (ScopeTimer sub = task1.getOrCreateChild("sub", 10).enter()) {
                            TimeServices.moveTimeForwardMsec(40);
                        }
                    }
                }
            }
        }

        String expected =
                "<ScopeTimer name=root intervals=[0.1000] min=0.1000 mean=0.1000 max=0.1000 children=[\n" +
                "    <ScopeTimer name=task1 intervals=[0.0100, 0.0200, 0.0700] min=0.0100 mean=0.0333 max=0.0700 children=[\n" +
                "        <ScopeTimer name=sub intervals=[0.0400] min=0.0400 mean=0.0400 max=0.0400>\n" +
                "    ]>\n" +
                "]>";

        Assert.assertEquals(expected, root.render());
        Assert.assertEquals("rendering must not change state", expected, root.render());
        Assert.assertEquals(expected, root.toString());
    }

    @Test
    public void testSiblingsAreSeparatedByCommaAndRenderedInCreationOrder() throws Exception {
        ScopeTimer root = new ScopeTimer("root");
        ScopeTimer b = root.getOrCreateChild("b");
        ScopeTimer a = root.getOrCreateChild("a");
        try (ScopeTimer t = a.enter()) {
            TimeServices.moveTimeForwardMsec(250);
        }
        try (ScopeTimer t = b.enter()) {
            TimeServices.moveTimeForwardMsec(500);
        }

        Assert.assertEquals(
                "<ScopeTimer name=root children=[\n" +
                "    <ScopeTimer name=b intervals=[0.5000] min=0.5000 mean=0.5000 max=0.5000>, \n" +
                "    <ScopeTimer name=a intervals=[0.2500] min=0.2500 mean=0.2500 max=0.2500>\n" +
                "]>",
                root.render());
    }

    @Test
    public void testUnmeasuredNodesRenderNameOnly() throws Exception {
        ScopeTimer root = new ScopeTimer("root");
        Assert.assertEquals("<ScopeTimer name=root>", root.render());

        ScopeTimer child = root.getOrCreateChild("child");
        Assert.assertEquals("\n    <ScopeTimer name=child>", child.render());
        Assert.assertEquals("<ScopeTimer name=root children=[\n    <ScopeTimer name=child>\n]>", root.render());
    }

    @Test
    public void testRenderingElidesIntervalsBeyondFive() throws Exception {
        ScopeTimer timer = new ScopeTimer("loop", 6);
        for (int i = 0; i < 8; i++) {
            try (ScopeTimer t = timer.enter()) {
                TimeServices.moveTimeForwardMsec(2);
            }
        }

        Assert.assertEquals(6, timer.getIntervalHistory().size());
        Assert.assertEquals("<ScopeTimer name=loop intervals=[0.0020, 0.0020, 0.0020, 0.0020, 0.0020, ...]" +
                " min=0.0020 mean=0.0020 max=0.0020>", timer.render());
    }
}
