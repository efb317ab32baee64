package org.janelia.vizbridge.image;

import java.util.Properties;

import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.cell.CellImgFactory;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.view.Views;
import org.janelia.vizbridge.config.ConfigProvider;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class DefaultBufferOwnershipPolicyTest {

    @Test
    public void onlyPlainArrayImgsAreViewed() {
        DefaultBufferOwnershipPolicy policy = new DefaultBufferOwnershipPolicy(true);

        assertEquals(BufferOwnership.VIEW, policy.decide(ArrayImgs.doubles(4, 4)));
        assertEquals(BufferOwnership.VIEW, policy.decide(ArrayImgs.unsignedLongs(3)));
        assertEquals(BufferOwnership.COPY, policy.decide(ArrayImgs.argbs(4, 4)));
        assertEquals(BufferOwnership.COPY, policy.decide(ArrayImgs.unsignedInts(4, 4).firstElement()));
        assertEquals(BufferOwnership.COPY, policy.decide(new CellImgFactory<>(new IntType(), 2).create(4, 4)));
        assertEquals(BufferOwnership.COPY, policy.decide(Views.translate(ArrayImgs.ints(4, 4), 1, 1)));
        assertEquals(BufferOwnership.COPY, policy.decide(new int[16]));
    }

    @Test
    public void viewsCanBeDisabledByConfig() {
        Properties properties = new Properties();
        properties.setProperty("BufferOwnership.AllowViews", "false");

        DefaultBufferOwnershipPolicy policy = DefaultBufferOwnershipPolicy.fromConfig(
                ConfigProvider.getInstance().fromProperties(properties).get());

        assertEquals(BufferOwnership.COPY, policy.decide(ArrayImgs.doubles(4, 4)));
    }
}
