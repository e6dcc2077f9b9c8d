package edu.isi.wdfa;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.Vector;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line counting of class n-gram patterns over a list of words
public class WDFATool {
	// version number. change this when updating!
	static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		// format of the input (and output data) - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
				"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// the alphabet: every segment a word may contain
		FlaggedOption segmentsopt = new FlaggedOption("segments",
				StringStringParser.getParser(),
				null,
				false,
				's',
				"segments",
				"space-separated segment inventory. Segments of the input not in the inventory are skipped");
		jsap.registerParameter(segmentsopt);

		// what we count
		FlaggedOption patternopt = new FlaggedOption("pattern",
				StringStringParser.getParser(),
				null,
				false,
				'p',
				"pattern",
				"class n-gram to count, as classes separated by '|', each class a comma-separated "+
				"list of segments (e.g. a,e|b|c). May be given several times; counts are reported in order");
		patternopt.setAllowMultipleDeclarations(true);
		jsap.registerParameter(patternopt);

		// timing
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				't',
				"time",
				"print timing information to stderr. Higher values of <time> print more");
		jsap.registerParameter(timeopt);

		// words to count over
		UnflaggedOption infileopt = new UnflaggedOption("infiles",
				StringStringParser.getParser(),
				null,
				false,
				true,
				"list of word files, one word per line with segments separated by whitespace. "+
				"The special symbol '-' (no quote) may be given once to read from STDIN");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);
		if (!config.success() || config.getBoolean("help"))
			return config;
		if (!config.contains("segments"))
			throw new ConfigureException("A segment inventory (-s) is required");
		if (!config.contains("pattern"))
			throw new ConfigureException("At least one pattern (-p) is required");
		if (!config.contains("infiles"))
			throw new ConfigureException("At least one input file is required");
		return config;
	}

	/** the inventory, split on whitespace, in order */
	public static ListSpace<String> parseSegments(String inventory) throws ConfigureException {
		String[] segs = inventory.trim().split("\\s+");
		if (segs.length == 0 || segs[0].length() == 0)
			throw new ConfigureException("Empty segment inventory");
		try {
			return new ListSpace<String>(Arrays.asList(segs));
		}
		catch (IllegalArgumentException e) {
			throw new ConfigureException("Bad segment inventory: "+e.getMessage(), e);
		}
	}

	/** a pattern like "a,e|b|c" as its list of classes */
	public static List<Set<String>> parsePattern(String pattern, ListSpace<String> segments) throws ConfigureException {
		ArrayList<Set<String>> ret = new ArrayList<Set<String>>();
		for (String cls : pattern.split("\\|", -1)) {
			HashSet<String> members = new HashSet<String>();
			for (String seg : cls.split(",")) {
				seg = seg.trim();
				if (seg.length() == 0)
					continue;
				if (!segments.contains(seg))
					throw new ConfigureException("Pattern "+pattern+" uses unknown segment "+seg);
				members.add(seg);
			}
			if (members.isEmpty())
				throw new ConfigureException("Pattern "+pattern+" has an empty class");
			ret.add(members);
		}
		if (ret.size() > NgramCounter.MAX_CLASSES)
			throw new ConfigureException("Pattern "+pattern+" has more than "+NgramCounter.MAX_CLASSES+" classes");
		return ret;
	}

	/** the segments of a word line that are in the inventory */
	public static List<String> readWord(String line, IndexSpace<String> segments) {
		boolean debug = false;
		ArrayList<String> ret = new ArrayList<String>();
		for (String seg : line.trim().split("\\s+")) {
			if (seg.length() == 0)
				continue;
			if (segments.contains(seg))
				ret.add(seg);
			else if (debug) Debug.debug(debug, "Skipping unknown segment "+seg);
		}
		return ret;
	}

	/**
	 * Write the pattern counts of every non-blank line of br to w, then a
	 * TOTAL line for br. Every line has numPatterns counts, even for words
	 * with no known segments. Returns the total.
	 */
	public static MultiCount countWords(WeightedDFA<Integer, String, MultiCount> counter, int numPatterns,
			BufferedReader br, Writer w) throws IOException {
		MultiCountMonoid mcm = new MultiCountMonoid();
		IndexSpace<String> segments = counter.getAlphabet();
		MultiCount zeros = MultiCount.zeros(numPatterns);
		MultiCount total = zeros;
		String line;
		while ((line = br.readLine()) != null) {
			if (line.trim().length() == 0)
				continue;
			MultiCount counts = mcm.append(zeros, counter.transduce(readWord(line, segments), mcm));
			total = mcm.append(total, counts);
			w.write(line.trim()+"\t"+counts+"\n");
		}
		w.write("TOTAL\t"+total+"\n");
		w.flush();
		return total;
	}

	// load files into buffered readers. detect stdin here and prevent multiple stdins.
	private static Vector<BufferedReader> loadFiles(String[] infiles, String encoding) throws ConfigureException, IOException {
		boolean debug = false;
		Vector<BufferedReader> ret = new Vector<BufferedReader>();
		boolean seenstdin = false;
		for (String name : infiles) {
			if (name.equals("-")) {
				if (seenstdin)
					throw new ConfigureException("Can only reference stdin (-) once in the list of files");
				seenstdin = true;
				Debug.debug(debug, "Reading from stdin");
				ret.add(new BufferedReader(new InputStreamReader(System.in, encoding)));
			}
			else {
				File f = new File(name);
				if (!f.isFile())
					throw new ConfigureException("Can't read input file "+name);
				Debug.debug(debug, "Reading from "+f.getName());
				ret.add(new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding)));
			}
		}
		return ret;
	}

	public static void main(String argv[]) throws Exception {
		Debug.prettyDebug("This is WDFATool, version "+VERSION);

		JSAP jsap = new JSAP();
		JSAPResult config = null;
		String encoding = null;
		ListSpace<String> segments = null;
		ArrayList<List<Set<String>>> patterns = new ArrayList<List<Set<String>>>();
		String[] infiles = null;

		// 1) Set up all parameters. Die on bad combinations.
		Date registerAllParametersTime = new Date();
		try {
			config = processParameters(jsap, argv);
			if (config.success() && !config.getBoolean("help")) {
				encoding = config.getString("encoding");
				Debug.setEncoding(encoding);
				if (config.contains("time"))
					Debug.setDbLevel(config.getInt("time"));
				segments = parseSegments(config.getString("segments"));
				for (String p : config.getStringArray("pattern"))
					patterns.add(parsePattern(p, segments));
				infiles = config.getStringArray("infiles");
			}
		}
		catch (JSAPException e) {
			System.err.println("WDFATool options improperly configured: "+e.getMessage());
			System.err.println("Try 'wdfatool -h' for a detailed help message");
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("WDFATool options improperly configured: "+e.getMessage());
			System.err.println("Try 'wdfatool -h' for a detailed help message");
			System.exit(1);
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: wdfatool ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			System.exit(0);
		}

		if (!config.success()) {
			for (Iterator errs = config.getErrorMessageIterator(); errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: wdfatool ");
			Debug.prettyDebug("             "+jsap.getUsage());
			System.exit(1);
		}
		Debug.dbtime(2, registerAllParametersTime, "register and configure parameters");

		// 2) Build the counter
		Date preBuildTime = new Date();
		WeightedDFA<Integer, String, MultiCount> counter = NgramCounter.multiCounter(segments, patterns);
		Debug.dbtime(1, preBuildTime, "built counter with "+counter.getNumStates()+" states");

		// 3) Count
		Vector<BufferedReader> brs = null;
		try {
			brs = loadFiles(infiles, encoding);
		}
		catch (ConfigureException e) {
			System.err.println("WDFATool options improperly configured: "+e.getMessage());
			System.exit(1);
		}
		OutputStreamWriter w = new OutputStreamWriter(System.out, encoding);
		Date preCountTime = new Date();
		for (BufferedReader br : brs) {
			try {
				countWords(counter, patterns.size(), br, w);
			}
			finally {
				br.close();
			}
		}
		Debug.dbtime(1, preCountTime, "counted patterns");
		Debug.dbtime(1, registerAllParametersTime, "total");
	}
}
