/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.exchange.gltf.material;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * {@link ImageDecoder} backed by the JDK's {@link ImageIO} readers.
 *
 * @author hal.hildebrand
 */
public class ImageIODecoder implements ImageDecoder {

    @Override
    public BufferedImage decode(byte[] data, String mimeType) throws IOException {
        var image = ImageIO.read(new ByteArrayInputStream(data));
        if (image == null) {
            throw new IOException("No ImageIO reader for " + (mimeType == null ? "image" : mimeType));
        }
        return image;
    }
}
