package arrivalgen;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class Util {
    static PrintStream openBufferedPrintStream(String path) throws FileNotFoundException {
        FileOutputStream fileStream = new FileOutputStream(path);
        BufferedOutputStream bufStream = new BufferedOutputStream(fileStream);
        return new PrintStream(bufStream, false, StandardCharsets.UTF_8);
    }

    static String outputFilename(String base, String extension, Integer runNum) {
        if (runNum == null)
            return String.format("%s.%s", base, extension);
        else
            return String.format("%s.%d.%s", base, runNum, extension);
    }

    static double mean(double[] vals) {
        double m = 0.0;
        for (int i = 0; i < vals.length; i++) {
            m += vals[i];
        }
        return m / vals.length;
    }

    static double sd(double[] vals) {
        double m = mean(vals);
        double sumSqDev = 0.0;
        for (int i = 0; i < vals.length; i++) {
            double dev = vals[i] - m;
            sumSqDev += dev * dev;
        }
        return Math.sqrt(sumSqDev / vals.length);
    }

    static double[] toArray(List<Integer> v) {
        double[] a = new double[v.size()];
        for (int i = 0; i < a.length; i++) {
            a[i] = v.get(i);
        }
        return a;
    }

    static String formatNumber(double x) {
        if (Double.isFinite(x)) {
            return String.format("%f", x);
        }
        else {
            return "";
        }
    }
}
