package io.jobs4j.discovery;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;

/**
 * Reads the binary name of the class declared by a class file without defining it.
 */
final class ClassFileNames {

    private static final int MAGIC = 0xCAFEBABE;

    private ClassFileNames() {
    }

    /**
     * @return binary name, e.g. {@code com.acme.jobs.SendEmailJob}
     * @throws ClassFormatError if the bytes are not a class file
     */
    static String binaryName(byte[] bytes) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            if (in.readInt() != MAGIC) {
                throw new ClassFormatError("Incompatible magic value");
            }
            in.readUnsignedShort(); // minor
            in.readUnsignedShort(); // major

            int count = in.readUnsignedShort();
            String[] utf8 = new String[count];
            int[] classNameIndex = new int[count];
            for (int i = 1; i < count; i++) {
                int tag = in.readUnsignedByte();
                switch (tag) {
                    case 1 -> utf8[i] = in.readUTF();
                    case 7 -> classNameIndex[i] = in.readUnsignedShort();
                    case 8, 16, 19, 20 -> in.skipBytes(2);
                    case 15 -> in.skipBytes(3);
                    case 3, 4, 9, 10, 11, 12, 17, 18 -> in.skipBytes(4);
                    case 5, 6 -> {
                        in.skipBytes(8);
                        i++; // long and double take two slots
                    }
                    default -> throw new ClassFormatError("Unknown constant pool tag " + tag + " at index " + i);
                }
            }

            in.readUnsignedShort(); // access flags
            int thisClass = in.readUnsignedShort();
            if (thisClass <= 0 || thisClass >= count || utf8[classNameIndex[thisClass]] == null) {
                throw new ClassFormatError("Invalid this_class index " + thisClass);
            }
            return utf8[classNameIndex[thisClass]].replace('/', '.');
        } catch (IOException e) {
            ClassFormatError error = new ClassFormatError("Truncated class file");
            error.initCause(e);
            throw error;
        }
    }
}
