package sift.core.type;

import org.junit.Assert;
import org.junit.Test;

public class PackageNameTest {

    @Test
    public void testEmptyNameIsNoPackage() {
        Assert.assertSame(PackageName.NONE, PackageName.of(null));
        Assert.assertSame(PackageName.NONE, PackageName.of(""));
        Assert.assertEquals("None", PackageName.NONE.toString());
    }

    @Test
    public void testQualify() {
        Assert.assertEquals("pkg.sub.Module.Cls.testA", PackageName.of("pkg.sub").qualify("Module.Cls.testA"));
        Assert.assertEquals("Module.Cls.testA", PackageName.NONE.qualify("Module.Cls.testA"));
    }

    @Test
    public void testPackageCalledNoneIsAPackage() {
        Assert.assertNotEquals(PackageName.NONE, PackageName.of("None"));
        Assert.assertEquals("None.Module", PackageName.of("None").qualify("Module"));
        Assert.assertEquals(PackageName.of("pkg"), PackageName.of("pkg"));
    }
}
